package edu.isi.wordlat;
/** for bad command-line options or an illegal expansion configuration,
    e.g. epsilon among the delimiters or a non-positive scale */
public class ConfigureException extends Exception {
	/** Constructs a new exception with the specified detail message. */
	public ConfigureException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
