package lab.guardian.adapter.store;

import lombok.Getter;

@Getter
public class StoreException extends RuntimeException {

    private final int status;

    public StoreException(String message, int status) {
        super(message);
        this.status = status;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }
}
