package org.jafc.ain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory representation of a bytecode object: the tables that code generation
 * and serialization consume. Tables are append-only; indices are positions in the lists.
 */
public class Ain {

    private final int version;
    private final List<AinStruct> structures = new ArrayList<>();
    private final List<AinFunction> functions = new ArrayList<>();
    private final List<AinVariable> globals = new ArrayList<>();
    private final List<AinInitval> initvals = new ArrayList<>();

    /**
     * @param version The format version; version 12 and later carry secondary variable names.
     */
    public Ain(int version) {
        this.version = version;
    }

    public int getVersion() {
        return version;
    }

    public List<AinStruct> getStructures() {
        return Collections.unmodifiableList(structures);
    }

    public List<AinFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<AinVariable> getGlobals() {
        return Collections.unmodifiableList(globals);
    }

    public List<AinInitval> getInitvals() {
        return Collections.unmodifiableList(initvals);
    }

    public int addStructure(AinStruct struct) {
        structures.add(struct);
        return structures.size() - 1;
    }

    public int addFunction(AinFunction function) {
        functions.add(function);
        return functions.size() - 1;
    }

    public int addGlobal(AinVariable global) {
        globals.add(global);
        return globals.size() - 1;
    }

    public void addInitval(AinInitval initval) {
        initvals.add(initval);
    }
}
