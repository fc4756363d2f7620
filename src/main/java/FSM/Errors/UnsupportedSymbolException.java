package FSM.Errors;

public class UnsupportedSymbolException extends AutomatonException {
    private final String symbol;

    public UnsupportedSymbolException(String symbol) {
        super("Symbol '" + symbol + "' is not part of the alphabet");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
