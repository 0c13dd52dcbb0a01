package dumb.metamath;

/**
 * One position of a formula's symbol sequence. Equality is by kind and label.
 */
sealed public interface Symbol extends Labeled permits Constant, Variable, FormulaVariable {

    default boolean isVariable() {
        return !(this instanceof Constant);
    }

    static boolean same(Symbol x, Symbol y) {
        return x == y || (x.getClass() == y.getClass() && x.label().equals(y.label()));
    }
}
