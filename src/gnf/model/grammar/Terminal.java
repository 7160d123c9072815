package gnf.model.grammar;

public class Terminal extends Symbol {

	public Terminal(String name) {
		super(name);
	}

	@Override
	public int getOrderKey() {
		return NO_ORDER;
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(SymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return getName().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Terminal other = (Terminal) obj;
		return getName().equals(other.getName());
	}

}
