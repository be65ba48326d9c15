package latex2go;

/**
 * Invalid command line; reported together with the usage text.
 */
public class UsageException extends Exception {
	public UsageException(String message) {
		super(message);
	}
}
