package io.fullerstack.rosdiscover.interpreter;

import java.util.Objects;

/**
 * Parsed arguments of a node of type {@code nodelet}.
 *
 * @param kind        which of the three nodelet forms was given
 * @param packageName package of the nodelet type (null for a manager)
 * @param nodeType    nodelet type (null for a manager)
 * @param manager     name of the hosting manager (only for {@link Kind#LOAD})
 */
record NodeletCommand(Kind kind, String packageName, String nodeType, String manager) {

    enum Kind {
        /** {@code manager}: starts a host for nodelets */
        MANAGER,
        /** {@code standalone <pkg>/<type>}: runs a nodelet in its own process */
        STANDALONE,
        /** {@code load <pkg>/<type> <manager>}: loads a nodelet into a manager */
        LOAD
    }

    /**
     * @param args trimmed argument string of the nodelet node
     * @throws MalformedNodeletArgsException if the arguments match none of the forms
     */
    static NodeletCommand parse(String args) {
        Objects.requireNonNull(args, "args cannot be null");
        if (args.equals("manager")) {
            return new NodeletCommand(Kind.MANAGER, null, null, null);
        }
        if (args.startsWith("standalone ")) {
            String[] type = splitType(args.substring("standalone ".length()), args);
            return new NodeletCommand(Kind.STANDALONE, type[0], type[1], null);
        }

        String[] tokens = args.split(" ", -1);
        if (tokens.length != 3) {
            throw new MalformedNodeletArgsException(args);
        }
        String[] type = splitType(tokens[1], args);
        return new NodeletCommand(Kind.LOAD, type[0], type[1], tokens[2]);
    }

    private static String[] splitType(String packageAndType, String args) {
        int slash = packageAndType.indexOf('/');
        if (slash < 0) {
            throw new MalformedNodeletArgsException(args);
        }
        return new String[] {packageAndType.substring(0, slash), packageAndType.substring(slash + 1)};
    }
}
