package com.forge.script.host;

/** Where print writes and where input reads. */
public interface HostIO {

    /** Writes text exactly as given; callers add any newline. */
    void print(String text);

    /** Next line without its terminator, or null at end of input. */
    String readLine();
}
