package resilient.resolver;

/** Driver-side failure that is not a lookup miss and may not recur (element not interactable, lost frame, ...). */
public class TransientDriverException extends LocatorException {

    public TransientDriverException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
