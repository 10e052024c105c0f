package org.fluxgen.compiler.types;

/**
 * A target-language package.
 *
 * @param path The import path, unique per package.
 * @param name The declared package name.
 */
public record GoPackage(String path, String name) {

    @Override
    public String toString() {
        return path;
    }
}
