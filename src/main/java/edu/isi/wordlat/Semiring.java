package edu.isi.wordlat;
import java.io.Serializable;
// the general semiring over double-valued weights. Subclasses do the operations.
// times accumulates weight along a path, ZERO marks non-final states.
public abstract class Semiring implements Serializable {
	public abstract double times(double a, double b);
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	public abstract boolean betteroreq(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	// so we can represent things differently on the inside
	public abstract double internalToPrint(double a);
	public abstract double printToInternal(double a);

	public boolean isZero(double a) {
		return a == ZERO();
	}

	// from the --semiring option
	public static Semiring get(String name) throws ConfigureException {
		if (name.equals("tropical"))
			return new TropicalSemiring();
		if (name.equals("real"))
			return new RealSemiring();
		throw new ConfigureException("Unexpected semiring type: "+name+"; valid values are tropical, real");
	}
}
