package edu.isi.wordlat;

/** Which label of an arc is compared against the delimiters and counted
    against the maximum word length. */
public enum MatchSide { INPUT, OUTPUT }
