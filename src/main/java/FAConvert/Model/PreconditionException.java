package FAConvert.Model;

/**
 * An operation was called on an automaton it does not accept,
 * e.g. determinizing an automaton that still has epsilon transitions.
 */
public class PreconditionException extends AutomatonException {

    public PreconditionException(String message) {
        super(message);
    }
}
