package edu.isi.wordlat;
/** for broken internal invariants, like two label sequences
    sharing one symbol id. Never expected in correct operation. */

public class UnexpectedCaseException extends Exception {
	/** Constructs a new exception with the specified detail message. */
	public UnexpectedCaseException(String message) { super(message); }
}
