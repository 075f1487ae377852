package ptag.model.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A root-relative node position. [0] is the root, [0, a, b] is the b-th child of the
 * a-th child of the root. Child indices are 1-based.
 */
public final class TreePath {

	private static final TreePath ROOT = new TreePath(Collections.singletonList(0));

	private final List<Integer> indices;

	private TreePath(List<Integer> indices) {
		this.indices = indices;
	}

	public static TreePath root() {
		return ROOT;
	}

	public static TreePath of(Integer... indices) {
		return of(Arrays.asList(indices));
	}

	public static TreePath of(List<Integer> indices) {
		return new TreePath(Collections.unmodifiableList(new ArrayList<>(indices)));
	}

	public TreePath append(int childIndex) {
		List<Integer> extended = new ArrayList<>(indices);
		extended.add(childIndex);
		return new TreePath(Collections.unmodifiableList(extended));
	}

	public boolean isRoot() {
		return indices.size() == 1 && indices.get(0) == 0;
	}

	/**
	 * A well-formed path is non-empty, starts at the root marker 0 and uses positive child indices.
	 */
	public boolean isWellFormed() {
		if (indices.isEmpty() || indices.get(0) != 0) {
			return false;
		}
		for (int i = 1; i < indices.size(); ++i) {
			if (indices.get(i) < 1) {
				return false;
			}
		}
		return true;
	}

	public int size() {
		return indices.size();
	}

	public int get(int i) {
		return indices.get(i);
	}

	public List<Integer> getIndices() {
		return indices;
	}

	@Override
	public int hashCode() {
		return indices.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return indices.equals(((TreePath) obj).indices);
	}

	@Override
	public String toString() {
		return indices.toString();
	}
}
