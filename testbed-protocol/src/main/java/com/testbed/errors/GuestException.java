package com.testbed.errors;

/**
 * Transport failure reported by a {@link com.testbed.guest.Guest} implementation
 * (push, pull or command start failed). A test that ran and exited non-zero is not a guest error.
 */
public final class GuestException extends TestbedException {

    private final String guestName;

    public GuestException(String guestName, String message, Throwable cause) {
        super(String.format("Guest '%s': %s", guestName, message), cause);
        this.guestName = guestName;
    }

    public GuestException(String guestName, String message) {
        this(guestName, message, null);
    }

    public String getGuestName() {
        return guestName;
    }
}
