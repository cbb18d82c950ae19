package org.jafc.compiler.ain;

import org.jafc.ain.Ain;
import org.jafc.ain.AinFunction;
import org.jafc.ain.AinInitval;
import org.jafc.ain.AinStruct;
import org.jafc.ain.AinVariable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Adapter that exposes an {@link Ain} object through the {@link IObjectModel} interface.
 * Keeps name indices so that lookups do not scan the tables.
 */
public final class AinObjectModelAdapter implements IObjectModel {

    private final Ain ain;
    private final Map<String, Integer> structsByName = new HashMap<>();
    private final Map<String, Integer> functionsByName = new HashMap<>();
    private final Map<String, Integer> globalsByName = new HashMap<>();

    /**
     * @param ain The object to populate. Entries already present are indexed by name.
     */
    public AinObjectModelAdapter(Ain ain) {
        this.ain = ain;
        for (int i = 0; i < ain.getStructures().size(); i++) {
            structsByName.putIfAbsent(ain.getStructures().get(i).getName(), i);
        }
        for (int i = 0; i < ain.getFunctions().size(); i++) {
            functionsByName.putIfAbsent(ain.getFunctions().get(i).getName(), i);
        }
        for (int i = 0; i < ain.getGlobals().size(); i++) {
            globalsByName.putIfAbsent(ain.getGlobals().get(i).getName(), i);
        }
    }

    /**
     * @return The underlying object.
     */
    public Ain getAin() {
        return ain;
    }

    @Override
    public int getVersion() {
        return ain.getVersion();
    }

    @Override
    public int addStruct(String name) {
        if (structsByName.containsKey(name)) {
            throw new IllegalArgumentException("Struct '" + name + "' already exists");
        }
        int structNo = ain.addStructure(new AinStruct(name));
        structsByName.put(name, structNo);
        return structNo;
    }

    @Override
    public boolean hasStruct(String name) {
        return structsByName.containsKey(name);
    }

    @Override
    public Optional<Integer> getStructNo(String name) {
        return Optional.ofNullable(structsByName.get(name));
    }

    @Override
    public AinStruct getStruct(int structNo) {
        checkIndex("struct", structNo, getStructCount());
        return ain.getStructures().get(structNo);
    }

    @Override
    public int getStructCount() {
        return ain.getStructures().size();
    }

    @Override
    public int addFunction(AinFunction function) {
        int funcNo = ain.addFunction(function);
        functionsByName.putIfAbsent(function.getName(), funcNo);
        return funcNo;
    }

    @Override
    public AinFunction getFunction(int funcNo) {
        checkIndex("function", funcNo, getFunctionCount());
        return ain.getFunctions().get(funcNo);
    }

    @Override
    public Optional<Integer> getFunctionNo(String name) {
        return Optional.ofNullable(functionsByName.get(name));
    }

    @Override
    public int getFunctionCount() {
        return ain.getFunctions().size();
    }

    @Override
    public int addGlobal(String name) {
        String name2 = ain.getVersion() >= 12 ? "" : null;
        int globalNo = ain.addGlobal(new AinVariable(name, name2, null));
        globalsByName.putIfAbsent(name, globalNo);
        return globalNo;
    }

    @Override
    public AinVariable getGlobal(int globalNo) {
        checkIndex("global", globalNo, getGlobalCount());
        return ain.getGlobals().get(globalNo);
    }

    @Override
    public Optional<Integer> getGlobalNo(String name) {
        return Optional.ofNullable(globalsByName.get(name));
    }

    @Override
    public int getGlobalCount() {
        return ain.getGlobals().size();
    }

    @Override
    public void addInitval(AinInitval initval) {
        checkIndex("global", initval.globalIndex(), getGlobalCount());
        ain.addInitval(initval);
    }

    @Override
    public int getInitvalCount() {
        return ain.getInitvals().size();
    }

    private static void checkIndex(String kind, int index, int size) {
        if (index < 0 || index >= size) {
            throw new IllegalStateException("Invalid " + kind + " index " + index + " (count " + size + ")");
        }
    }
}
