package com.aki.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only store behind REFERENCE values. Addresses are indexes into the
 * backing list and stay valid for the lifetime of the owning interpreter.
 */
public class Heap {
    private final List<Value> objects = new ArrayList<>();

    public int allocate(Value value) {
        objects.add(value);
        return objects.size() - 1;
    }

    public Value load(int address) {
        if (address < 0 || address >= objects.size()) {
            throw new AkiRuntimeException(ErrorKind.INVALID_REFERENCE, "Invalid heap address: " + address);
        }
        return objects.get(address);
    }

    public int size() {
        return objects.size();
    }
}
