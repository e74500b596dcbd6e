package com.ram.script.parser;

import java.util.List;

/** Header form: {@code if <left> is <right>} */
public final class IfBlock extends Block {

    public IfBlock(SourceLine headerLine, List<SourceNode> children) {
        super(headerLine, children);
    }

    @Override
    public Kind kind() { return Kind.IF; }
}
