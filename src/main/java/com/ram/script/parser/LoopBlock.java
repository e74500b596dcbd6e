package com.ram.script.parser;

import java.util.List;

/** Header form: {@code loop with <var> from <start> to <stop>} */
public final class LoopBlock extends Block {

    public LoopBlock(SourceLine headerLine, List<SourceNode> children) {
        super(headerLine, children);
    }

    @Override
    public Kind kind() { return Kind.LOOP; }
}
