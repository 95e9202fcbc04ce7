package FAConvert.Model;

/**
 * A state, symbol, or initial/final designation is not part of the declared sets.
 */
public class SchemaException extends AutomatonException {

    public SchemaException(String message) {
        super(message);
    }
}
