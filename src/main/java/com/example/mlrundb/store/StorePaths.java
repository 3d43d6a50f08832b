package com.example.mlrundb.store;

/**
 * Item paths in the backend:
 * <pre>
 * /run/{project}/{uid}
 * /artifact/{project}/{key}.{uid}
 * /artifact/{project}/{key}.{tag}
 * </pre>
 */
public final class StorePaths {

    private StorePaths() {
    }

    public static String run(String project, String uid) {
        return runs(project) + uid;
    }

    public static String runs(String project) {
        return "/run/" + project + "/";
    }

    /** {@code version} is either a producing run uid or a tag. */
    public static String artifact(String project, String key, String version) {
        return artifacts(project) + key + "." + version;
    }

    public static String artifacts(String project) {
        return "/artifact/" + project + "/";
    }

    /** Last segment of {@code path}. */
    public static String name(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** Everything up to and including the last {@code /}. */
    public static String directory(String path) {
        return path.substring(0, path.lastIndexOf('/') + 1);
    }

    /** Normalizes a query prefix to end with {@code /}. */
    public static String asDirectory(String prefix) {
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
