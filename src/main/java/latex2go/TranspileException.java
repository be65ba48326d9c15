package latex2go;

/**
 * Failure of one stage of {@link TranspileService#run()}. The message names the
 * stage; the cause is the stage's own exception.
 */
public class TranspileException extends Exception {
	public TranspileException(String stage, Throwable cause) {
		super(stage + ": " + cause.getMessage(), cause);
	}
}
