package FAConvert.Model;

/**
 * Base class of all errors raised by the automaton transformations.
 * Subclasses tell a caller whether the input has to be fixed ({@link SchemaException}),
 * whether an operation was applied to the wrong kind of automaton ({@link PreconditionException}),
 * or whether a resource bound was hit ({@link StateLimitExceededException}).
 */
public abstract class AutomatonException extends RuntimeException {

    protected AutomatonException(String message) {
        super(message);
    }
}
