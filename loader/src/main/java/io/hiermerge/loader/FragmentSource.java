// file: loader/src/main/java/io/hiermerge/loader/FragmentSource.java
package io.hiermerge.loader;

import io.hiermerge.core.Fragment;

import java.util.List;

/**
 * Supplies the fragments for one entity, each with its hierarchy depth
 * already resolved. The engine never sees where they came from.
 */
public interface FragmentSource {

    /**
     * @throws FragmentLoadException on any read, render or parse failure
     */
    List<Fragment> load(FragmentQuery query);
}
