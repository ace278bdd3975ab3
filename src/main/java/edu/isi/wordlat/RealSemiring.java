package edu.isi.wordlat;

// real is +, *, 0, 1 over probabilities, stored internally as negative logs
// so that times is addition
public class RealSemiring extends Semiring {

	public double times(double a, double b) {
		return a+b;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public double ZERO(){ return Double.POSITIVE_INFINITY;}

	public double ONE() {
		return 0;
	}
	public double internalToPrint(double a) { return Math.exp(-a);}
	public double printToInternal(double a) { return -Math.log(a);}
	public String toString() { return "real"; }
}
