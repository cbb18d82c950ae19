package org.jafc.compiler.ain;

import org.jafc.ain.AinFunction;
import org.jafc.ain.AinInitval;
import org.jafc.ain.AinStruct;
import org.jafc.ain.AinVariable;

import java.util.Optional;

/**
 * Stable object model interface used by the analyzer to avoid direct coupling
 * to the bytecode object's storage. All tables are append-only.
 */
public interface IObjectModel {

    /**
     * @return The format version of the object being built.
     */
    int getVersion();

    /**
     * Creates an empty structure.
     * @param name The structure name.
     * @return The index of the new structure.
     * @throws IllegalArgumentException if a structure with that name exists.
     */
    int addStruct(String name);

    /**
     * @param name The structure name.
     * @return {@code true} if a structure with this name exists.
     */
    boolean hasStruct(String name);

    /**
     * @param name The structure name.
     * @return The structure index, or empty if no such structure exists.
     */
    Optional<Integer> getStructNo(String name);

    /**
     * @param structNo A structure index.
     * @return The structure.
     */
    AinStruct getStruct(int structNo);

    int getStructCount();

    /**
     * Appends a complete function record.
     * @param function The function.
     * @return The index assigned to the function.
     */
    int addFunction(AinFunction function);

    /**
     * @param funcNo A function index.
     * @return The function.
     */
    AinFunction getFunction(int funcNo);

    /**
     * @param name The function name.
     * @return The index of the first function with this name, or empty.
     */
    Optional<Integer> getFunctionNo(String name);

    int getFunctionCount();

    /**
     * Appends a global without a type; the caller fills in the type via {@link #getGlobal(int)}.
     * @param name The global's name.
     * @return The index assigned to the global.
     */
    int addGlobal(String name);

    /**
     * @param globalNo A global index.
     * @return The global variable.
     */
    AinVariable getGlobal(int globalNo);

    /**
     * @param name The global's name.
     * @return The index of the global, or empty.
     */
    Optional<Integer> getGlobalNo(String name);

    int getGlobalCount();

    /**
     * Appends the initial value of a global.
     * @param initval The initial value, keyed by global index.
     */
    void addInitval(AinInitval initval);

    int getInitvalCount();
}
