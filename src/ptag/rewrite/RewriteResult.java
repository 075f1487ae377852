package ptag.rewrite;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TreePath;

public abstract class RewriteResult {

	private static class Success extends RewriteResult {

		private final InternalNode tree;

		Success(InternalNode tree) {
			this.tree = tree;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public InternalNode getSuccess() {
			return tree;
		}

		@Override
		public RewriteFailure getFailure() {
			throw new IllegalStateException("Tried to get failure of successful rewrite " + tree);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Success && tree.equals(((Success) obj).tree);
		}

		@Override
		public int hashCode() {
			return tree.hashCode();
		}

		@Override
		public String toString() {
			return tree.toString();
		}
	}

	private static class Failure extends RewriteResult {

		private final RewriteFailure failure;

		Failure(RewriteFailure failure) {
			this.failure = failure;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public InternalNode getSuccess() {
			throw new IllegalStateException("Rewrite failed with " + failure + ", cannot get result");
		}

		@Override
		public RewriteFailure getFailure() {
			return failure;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Failure && failure.equals(((Failure) obj).failure);
		}

		@Override
		public int hashCode() {
			return failure.hashCode();
		}

		@Override
		public String toString() {
			return failure.toString();
		}
	}

	public abstract boolean isSuccess();
	public abstract InternalNode getSuccess();
	public abstract RewriteFailure getFailure();

	public static RewriteResult success(InternalNode tree) {
		return new Success(tree);
	}

	public static RewriteResult failure(RewriteFailure.Kind kind, TreePath position, String detail) {
		return new Failure(new RewriteFailure(kind, position, detail));
	}

}
