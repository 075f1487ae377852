package ptag.formatters;

import ptag.automaton.Derivation;
import ptag.automaton.DerivationStep;

import java.io.IOException;
import java.util.List;

/**
 * Writes derivations as a numbered trace, one block per parse and one entry per operation.
 */
public class DerivationFormatter {

	private final IndentingWriter out;

	public DerivationFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void format(List<Derivation> derivations) throws IOException {
		int parse = 1;
		for (Derivation derivation : derivations) {
			out.write("**** For Parse " + parse + " ****");
			out.newLine();
			try (IndentingWriter.Indent ignored = out.indent()) {
				int operation = 1;
				for (DerivationStep step : derivation.getSteps()) {
					format(operation, step);
					++operation;
				}
			}
			out.write("*************************");
			out.newLine();
			++parse;
		}
	}

	private void format(int operation, DerivationStep step) throws IOException {
		out.write("**** Operation " + operation + " ****");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent(5)) {
			out.write("Tree1 = " + step.getTarget());
			out.newLine();
			out.write("Tree2 = " + step.getInserted());
			out.newLine();
			out.write("op (S or A) = " + step.getKind().getCode());
			out.newLine();
			out.write("Position = " + step.getPosition());
			out.newLine();
			out.write("Result = " + step.getResult());
			out.newLine();
		}
	}
}
