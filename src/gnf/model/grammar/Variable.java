package gnf.model.grammar;

/**
 * A grammar variable. The order key places the variable in the total order A_1 < A_2 < ... < A_m
 * that forward substitution relies on. Auxiliary variables are introduced by the conversion itself
 * and always carry keys above those of the variables they were derived from.
 */
public class Variable extends Symbol {

	private final int orderKey;
	private final boolean auxiliary;

	public Variable(String name, int orderKey) {
		this(name, orderKey, false);
	}

	public Variable(String name, int orderKey, boolean auxiliary) {
		super(name);
		if (orderKey < 0) {
			throw new IllegalArgumentException("variable " + name + " needs a non-negative order key, got " + orderKey);
		}
		this.orderKey = orderKey;
		this.auxiliary = auxiliary;
	}

	@Override
	public int getOrderKey() {
		return orderKey;
	}

	public boolean isAuxiliary() {
		return auxiliary;
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	@Override
	public <T, E extends Throwable> T accept(SymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + getName().hashCode();
		result = prime * result + orderKey;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Variable other = (Variable) obj;
		return orderKey == other.orderKey && getName().equals(other.getName());
	}

}
