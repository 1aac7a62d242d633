package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.context.NodeContext;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import lombok.experimental.UtilityClass;

/**
 * Models for the {@code topic_tools} package.
 */
@UtilityClass
public class TopicToolsModels {

    private final String ANY_MSG = "topic_tools/AnyMsg";

    /**
     * {@code topic_tools/relay <intopic> [outtopic]}; the output defaults to {@code <intopic>_relay}.
     *
     * @throws IllegalArgumentException if no input topic is given
     */
    public void relay(NodeContext c) {
        String[] args = c.args().isBlank() ? new String[0] : c.args().trim().split("\\s+");
        if (args.length == 0) {
            throw new IllegalArgumentException("topic_tools/relay [" + c.name() + "] requires an input topic");
        }
        String in = args[0];
        String out = args.length > 1 ? args[1] : in + "_relay";

        c.readParameter("~lazy", ParameterValue.of(false));
        c.readParameter("~unreliable", ParameterValue.of(false));

        c.subscribe(in, ANY_MSG);
        c.publish(out, ANY_MSG);
    }
}
