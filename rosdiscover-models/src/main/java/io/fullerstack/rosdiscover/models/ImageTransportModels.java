package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.context.NodeContext;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Models for the {@code image_transport} package.
 */
@UtilityClass
public class ImageTransportModels {

    private final Logger logger = LoggerFactory.getLogger(ImageTransportModels.class);

    private final Set<String> TRANSPORTS = Set.of("raw", "compressed", "theora");

    /**
     * {@code image_transport/republish <in_transport> in:=<topic> [out_transport] out:=<topic>}.
     * Topics default to {@code in} and {@code out}, and are usually renamed by remapping.
     */
    public void republish(NodeContext c) {
        String in = "in";
        String out = "out";

        for (String arg : c.args().split(" ")) {
            if (arg.isEmpty() || TRANSPORTS.contains(arg)) {
                continue;
            }
            if (arg.startsWith("in:=")) {
                in = arg.substring("in:=".length());
            } else if (arg.startsWith("out:=")) {
                out = arg.substring("out:=".length());
            } else {
                logger.error("\"{}\" is not a valid argument for image_transport/republish", arg);
            }
        }

        c.subscribe(in, "sensor_msgs/Image");
        c.publish(out, "sensor_msgs/Image");
    }
}
