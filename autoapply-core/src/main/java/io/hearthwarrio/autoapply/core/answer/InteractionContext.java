package io.hearthwarrio.autoapply.core.answer;

/**
 * State of one field-resolution pass over a page, built fresh by the navigator for every pass.
 */
public final class InteractionContext {

    private final String caller;
    private final int depth;
    private final String verificationCode;
    private final int verificationCells;

    public InteractionContext(String caller, int depth, String verificationCode, int verificationCells) {
        this.caller = caller == null ? "" : caller;
        this.depth = depth;
        this.verificationCode = verificationCode;
        this.verificationCells = verificationCells;
    }

    public static InteractionContext root(String caller) {
        return new InteractionContext(caller, 0, null, 0);
    }

    /**
     * @param cells number of verification inputs on the page; a single cell takes the whole code
     */
    public InteractionContext withVerificationCode(String code, int cells) {
        return new InteractionContext(caller, depth, code, cells);
    }

    public InteractionContext deeper() {
        return new InteractionContext(caller, depth + 1, verificationCode, verificationCells);
    }

    /**
     * Identity used when queuing for the file picker.
     */
    public String caller() {
        return caller;
    }

    public int depth() {
        return depth;
    }

    /**
     * Code fetched from the mailbox for this page, or null.
     */
    public String verificationCode() {
        return verificationCode;
    }

    public int verificationCells() {
        return verificationCells;
    }
}
