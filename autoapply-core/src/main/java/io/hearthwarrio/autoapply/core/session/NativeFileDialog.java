package io.hearthwarrio.autoapply.core.session;

import java.nio.file.Path;

/**
 * OS-level file picker. Only one can be open system-wide, so callers go through the upload queue.
 */
public interface NativeFileDialog {

    NativeFileDialog NONE = new NativeFileDialog() {
        @Override
        public boolean isOpen() {
            return false;
        }

        @Override
        public boolean choose(Path file) {
            return false;
        }

        @Override
        public void dismiss() {
            // never open
        }
    };

    boolean isOpen();

    /**
     * Types the path into the open dialog and confirms it.
     *
     * @return true when the dialog accepted the file
     */
    boolean choose(Path file);

    /**
     * Closes the dialog if it is still open.
     */
    void dismiss();
}
