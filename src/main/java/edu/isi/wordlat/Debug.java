package edu.isi.wordlat;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics to stderr. prettyDebug always prints, debug prints when the
// caller's flag is on, dbtime prints when the timing level is high enough
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	private static void write(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		write(s);
	}

	// per-method debugging, prefixed with the calling class and method
	public static void debug(boolean d, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		write(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
	}

	private static int dblevel=-1;
	public static void setDbLevel(int i) {
		dblevel = i;
	}

	// elapsed time between two marks, if the global level is at least needlevel
	public static void dbtime(int needlevel, Date pta, Date ptb, String msg) {
		if (dblevel < needlevel)
			return;
		write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
	}

	// elapsed time since pta
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(needlevel, pta, new Date(), msg);
	}
}
