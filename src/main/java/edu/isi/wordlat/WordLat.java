package edu.isi.wordlat;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.util.Date;

import gnu.trove.set.hash.TIntHashSet;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.DoubleStringParser;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class WordLat {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// delimiters are matched against the output side of the character lattices
	static final MatchSide MATCH_SIDE = MatchSide.OUTPUT;

	static final String DESCRIPTION =
		"Convert character-level lattices into word-level lattices by expanding the subpaths "+
		"in between any two separator symbols.\n\n"+
		"Keep in mind that this expansion has an exponential cost. For instance, if the set of "+
		"separator symbols was empty, all paths of the input lattice would be expanded, so that "+
		"each arc of the output lattice would be a full path of the input lattice. The growth is "+
		"constrained by the separator symbols, and by two pruning mechanisms: --beam prunes the "+
		"character lattices before expansion, and --max-length drops any word longer than the "+
		"given number of characters.\n\n"+
		" e.g.: wordlat \"3 4\" chars.lat words.lat";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		FlaggedOption semiringtype = new FlaggedOption("srtype",
				EnumeratedStringParser.getParser("tropical; real"),
				"tropical",
				true,
				'm',
				"semiring",
				"type of weights: tropical (costs, the usual lattice weights) or real "+
				"(probabilities)");
		jsap.registerParameter(semiringtype);

		FlaggedOption maxlenopt = new FlaggedOption("maxlength",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"max-length",
				"maximum length (in characters) of a word. Longer words are removed from the output. "+
				"Unbounded by default");
		jsap.registerParameter(maxlenopt);

		FlaggedOption beamopt = new FlaggedOption("beam",
				DoubleStringParser.getParser(),
				null,
				false,
				'b',
				"beam",
				"prune the character lattices before expansion, keeping only arcs on paths within <beam> "+
				"of the best path (applied after scaling). No pruning by default");
		jsap.registerParameter(beamopt);

		FlaggedOption scaleopt = new FlaggedOption("scale",
				DoubleStringParser.getParser(),
				"1.0",
				true,
				JSAP.NO_SHORTFLAG,
				"scale",
				"scaling factor applied to the lattice weights before beam pruning; the weights are "+
				"scaled back before expansion");
		jsap.registerParameter(scaleopt);

		FlaggedOption symbolsopt = new FlaggedOption("savesymbols",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"save-symbols",
				"if given, all lattices use the same symbol table, which is written to this file. "+
				"Otherwise each lattice carries its own symbol table and is written with word names");
		jsap.registerParameter(symbolsopt);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"Print timing information to stderr at a variety of levels: 0+ for "+
				"total operation, 1+ for each processing stage, 2+ for each lattice");
		jsap.registerParameter(timeopt);

		UnflaggedOption delimopt = new UnflaggedOption("separators",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"whitespace separated list of separator symbols (integers, not 0)");
		jsap.registerParameter(delimopt);

		UnflaggedOption inopt = new UnflaggedOption("infile",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"character lattice archive to read, or - for stdin");
		jsap.registerParameter(inopt);

		UnflaggedOption outopt = new UnflaggedOption("outfile",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"word lattice archive to write, or - for stdout");
		jsap.registerParameter(outopt);

		JSAPResult config = jsap.parse(argv);
		if (config.contains("maxlength") && config.getInt("maxlength") < 0)
			throw new ConfigureException("--max-length must be non-negative");
		if (config.contains("beam") && config.getDouble("beam") < 0)
			throw new ConfigureException("--beam must be non-negative");
		if (config.getDouble("scale", 1.0) <= 0.0)
			throw new ConfigureException("--scale must be strictly greater than 0.0!");
		return config;
	}

	// build the converter from parsed options
	static CharToWordConverter makeConverter(JSAPResult config) throws ConfigureException {
		TIntHashSet delims = CharToWordConverter.parseDelimiters(config.getString("separators"));
		int maxLength = config.contains("maxlength") ? config.getInt("maxlength") : Integer.MAX_VALUE;
		double beam = config.contains("beam") ? config.getDouble("beam") : Double.POSITIVE_INFINITY;
		double scale = config.getDouble("scale");
		SymbolScope scope = config.contains("savesymbols") ? SymbolScope.SHARED : SymbolScope.PER_LATTICE;
		return new CharToWordConverter(delims, maxLength, beam, scale, MATCH_SIDE, scope);
	}

	private static BufferedReader openInput(String name, String encoding) throws FileNotFoundException, IOException {
		if (name.equals("-"))
			return new BufferedReader(new InputStreamReader(System.in, encoding));
		return new BufferedReader(new InputStreamReader(new FileInputStream(name), encoding));
	}

	private static OutputStreamWriter openOutput(String name, String encoding) throws FileNotFoundException, IOException {
		if (name.equals("-"))
			return new OutputStreamWriter(System.out, encoding);
		return new OutputStreamWriter(new FileOutputStream(name), encoding);
	}

	// expand every lattice of infile into outfile. Standard input and output
	// are left open so later output (e.g. the symbol table) can still reach them
	static int expandArchive(String infile, String outfile, String encoding, Semiring semiring,
			CharToWordConverter converter) throws IOException, DataFormatException, UnexpectedCaseException {
		LatticeReader reader = null;
		LatticeWriter writer = null;
		try {
			reader = new LatticeReader(openInput(infile, encoding), semiring);
			writer = new LatticeWriter(openOutput(outfile, encoding));
			return converter.convertAll(reader, writer);
		}
		finally {
			try {
				if (writer != null) {
					if (outfile.equals("-"))
						writer.flush();
					else
						writer.close();
				}
			}
			finally {
				if (reader != null && !infile.equals("-"))
					reader.close();
			}
		}
	}

	// write the shared symbol table to symfile, or to stdout for -
	static void saveSymbols(String symfile, String encoding, CharToWordConverter converter)
		throws IOException, UnexpectedCaseException {
		OutputStreamWriter w = openOutput(symfile, encoding);
		try {
			converter.writeSymbols(w);
		}
		finally {
			if (symfile.equals("-"))
				w.flush();
			else
				w.close();
		}
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is wordlat, version "+VERSION);
		Date startTime = new Date();

		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		Semiring semiring = null;
		CharToWordConverter converter = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			if (config.getBoolean("help")) {
				Debug.prettyDebug("Usage: wordlat ");
				Debug.prettyDebug("             "+jsap.getUsage());
				Debug.prettyDebug("");
				Debug.prettyDebug(DESCRIPTION);
				Debug.prettyDebug("");
				Debug.prettyDebug(jsap.getHelp());
				System.exit(0);
			}
			if (!config.success()) {
				for (java.util.Iterator errs = config.getErrorMessageIterator(); errs.hasNext();)
					Debug.prettyDebug("Error: " + errs.next());
				Debug.prettyDebug("Usage: wordlat ");
				Debug.prettyDebug("             "+jsap.getUsage());
				System.exit(1);
			}
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			semiring = Semiring.get(config.getString("srtype"));
			converter = makeConverter(config);
		}
		catch (JSAPException e) {
			System.err.println("wordlat options improperly configured: "+e.getMessage());
			System.err.println("Try 'wordlat -h' for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("wordlat options improperly configured: "+e.getMessage());
			System.err.println("Try 'wordlat -h' for a detailed help message");
			System.exit(1);
		}
		Debug.dbtime(1, startTime, "configure parameters");

		// 2) Expand every lattice
		int count = 0;
		try {
			Date preExpandTime = new Date();
			count = expandArchive(config.getString("infile"), config.getString("outfile"), encoding, semiring, converter);
			Debug.dbtime(1, preExpandTime, "expand "+count+" lattices");
		}
		catch (FileNotFoundException e) {
			System.err.println("Lattice file not found: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading lattices: "+e.getMessage());
			System.exit(1);
		}
		catch (UnexpectedCaseException e) {
			System.err.println("Internal error while expanding lattices: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing lattices: "+e.getMessage());
			System.exit(1);
		}

		// 3) Common symbol table, if asked for. The lattices are already written.
		if (converter.getScope() == SymbolScope.SHARED) {
			String symfile = config.getString("savesymbols");
			try {
				saveSymbols(symfile, encoding, converter);
			}
			catch (IOException e) {
				System.err.println("Couldn't write symbol table to "+symfile+": "+e.getMessage());
				System.exit(1);
			}
			catch (UnexpectedCaseException e) {
				System.err.println("Internal error while building symbol table: "+e.getMessage());
				System.exit(1);
			}
		}
		Debug.prettyDebug("Done, "+count+" lattices");
		Debug.dbtime(0, startTime, "total operation");
	}
}
