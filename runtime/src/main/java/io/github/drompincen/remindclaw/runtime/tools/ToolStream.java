package io.github.drompincen.remindclaw.runtime.tools;

public interface ToolStream {

    ToolStream NO_OP = new ToolStream() {
        @Override public void progress(int percent, String message) {}
        @Override public void warning(String message) {}
    };

    void progress(int percent, String message);

    void warning(String message);
}
