package edu.isi.wordlat;
/** for syntax errors in a lattice archive */

public class DataFormatException extends Exception {
	private int lineNumber = -1;
	/** Constructs a new exception pointing at a line of the archive (one-based). */
	public DataFormatException(int line, String message) {
		super("line "+line+": "+message);
		lineNumber = line;
	}
	/** Constructs a new exception with the specified detail message and cause. */
	public DataFormatException(int line, String message, Throwable cause) {
		super("line "+line+": "+message, cause);
		lineNumber = line;
	}
	// -1 if unknown
	public int getLineNumber() { return lineNumber; }
}
