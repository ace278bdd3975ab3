package edu.isi.wordlat;

// tropical weights: times is +, ZERO is +INF, ONE is 0. Lattice costs live here.
public class TropicalSemiring extends Semiring {
	public double times(double a, double b) {
		return a+b;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public double ZERO(){return  Double.POSITIVE_INFINITY;}
	public double ONE() {
		return 0;
	}
	public double internalToPrint(double a) { return a;}
	public double printToInternal(double a) { return a;}
	public String toString() { return "tropical"; }
}
