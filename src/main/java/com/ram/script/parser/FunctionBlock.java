package com.ram.script.parser;

import java.util.List;

/** Header form: {@code new function <name> takes (<params>)} */
public final class FunctionBlock extends Block {

    public FunctionBlock(SourceLine headerLine, List<SourceNode> children) {
        super(headerLine, children);
    }

    @Override
    public Kind kind() { return Kind.FUNCTION; }
}
