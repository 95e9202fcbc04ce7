package FAConvert.Model;

public class StateLimitExceededException extends AutomatonException {
    private final int limit;

    public StateLimitExceededException(int limit) {
        super("Result exceeds the limit of " + limit + " states");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
