package edu.isi.wordlat;

import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

// names for labels, kept in id order
public class SymbolTable {
	private TreeMap<Integer, String> key2name;
	private HashMap<String, Integer> name2key;

	public SymbolTable() {
		key2name = new TreeMap<Integer, String>();
		name2key = new HashMap<String, Integer>();
	}

	/**
	 * Adds name under key. If name is already present its existing key is
	 * returned and nothing changes, so callers can compare the return value
	 * with the key they asked for.
	 */
	public int addSymbol(String name, int key) {
		if (name2key.containsKey(name))
			return name2key.get(name);
		if (key2name.containsKey(key))
			throw new IllegalArgumentException("Key "+key+" already names "+key2name.get(key)+"; can't also name "+name);
		key2name.put(key, name);
		name2key.put(name, key);
		return key;
	}

	// null if absent
	public String find(int key) {
		return key2name.get(key);
	}
	// -1 if absent
	public int find(String name) {
		Integer k = name2key.get(name);
		return k == null ? -1 : k;
	}

	public int size() { return key2name.size(); }

	/** one "name TAB id" line per entry, ascending by id */
	public void writeText(Writer w) throws IOException {
		for (Map.Entry<Integer, String> e : key2name.entrySet())
			w.write(e.getValue()+"\t"+e.getKey()+"\n");
		w.flush();
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (Map.Entry<Integer, String> e : key2name.entrySet())
			sb.append(e.getKey()+" "+e.getValue()+"\n");
		return sb.toString();
	}
}
