package com.forge.script.parser;

/** One active call on the interpreter's call stack. */
public class CallFrame {
    final String functionName;
    final Span callSite;

    CallFrame(String functionName, Span callSite) {
        this.functionName = functionName;
        this.callSite = callSite;
    }

    /** Trail entry attached to errors that escape this call. */
    String describe() {
        return "calling '" + functionName + "' at " + callSite.position();
    }
}
