package metaheuristics.ga;

/**
 * Raised when no individual satisfying the domain-validity predicate could be
 * generated within the allowed number of attempts.
 */
@SuppressWarnings("serial")
public class UnsatisfiableConstraintException extends RuntimeException {

	private final int attempts;

	public UnsatisfiableConstraintException(String message, int attempts) {
		super(message);
		this.attempts = attempts;
	}

	public UnsatisfiableConstraintException(int attempts) {
		this("Validity predicate unsatisfiable: no valid individual after " + attempts + " attempts", attempts);
	}

	public int getAttempts() {
		return attempts;
	}

}
