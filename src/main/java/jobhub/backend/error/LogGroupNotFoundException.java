package jobhub.backend.error;

public class LogGroupNotFoundException extends NotFoundException {

    public LogGroupNotFoundException(String group) {
        super("Log group not found: " + group);
    }
}
