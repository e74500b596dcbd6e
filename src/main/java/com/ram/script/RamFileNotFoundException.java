package com.ram.script;

public class RamFileNotFoundException extends RamFileException {
    private static final long serialVersionUID = 1L;

    public RamFileNotFoundException(String filePath) {
        super("File path '" + filePath + "' does not exist.");
    }
}
