package me.christianrobert.shellast.ast.element;

/**
 * What a redirect points at: a file name (word) or a file descriptor number.
 *
 * <p>Exactly two cases exist, {@link File} and {@link Fd}. For here-documents the
 * file case carries the document body.
 *
 * <p>The interchange codec writes it as {@code {"file": "name"}} or {@code {"fd": 2}}.
 */
public abstract class RedirectTarget {

    private RedirectTarget() {
    }

    public static File file(String name) {
        return new File(name);
    }

    public static Fd fd(int fd) {
        return new Fd(fd);
    }

    public abstract boolean isFile();

    public static final class File extends RedirectTarget {

        private final String name;

        private File(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Redirect file name cannot be null");
            }
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean isFile() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof File && name.equals(((File) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "File{" + name + "}";
        }
    }

    public static final class Fd extends RedirectTarget {

        private final int fd;

        private Fd(int fd) {
            this.fd = fd;
        }

        public int getFd() {
            return fd;
        }

        @Override
        public boolean isFile() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fd && fd == ((Fd) o).fd;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(fd);
        }

        @Override
        public String toString() {
            return "Fd{" + fd + "}";
        }
    }
}
