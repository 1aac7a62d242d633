package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.context.NodeContext;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Models for the packages that publish a robot's kinematic state:
 * {@code robot_state_publisher} and {@code joint_state_publisher}.
 */
@UtilityClass
public class RobotModelModels {

    private final Logger logger = LoggerFactory.getLogger(RobotModelModels.class);

    private final String JOINT_STATE = "sensor_msgs/JointState";
    private final String TF_MESSAGE = "tf2_msgs/TFMessage";

    public void robotStatePublisher(NodeContext c) {
        c.readParameter("robot_description");
        c.readParameter("~publish_frequency", ParameterValue.of(50.0));
        c.readParameter("~tf_prefix", ParameterValue.of(""));
        boolean useTfStatic = c.readParameter("~use_tf_static", ParameterValue.of(true)).booleanOr(true);

        c.subscribe("joint_states", JOINT_STATE);
        c.publish("/tf", TF_MESSAGE);
        if (useTfStatic) {
            c.publish("/tf_static", TF_MESSAGE);
        }
    }

    /**
     * Also subscribes to every topic listed in {@code ~source_list}.
     */
    public void jointStatePublisher(NodeContext c) {
        c.readParameter("robot_description");
        c.readParameter("~rate", ParameterValue.of(10));
        c.readParameter("~use_gui", ParameterValue.of(false));
        List<ParameterValue> sources =
            c.readParameter("~source_list", ParameterValue.of(List.of())).listOr(List.of());

        for (ParameterValue source : sources) {
            if (source instanceof ParameterValue.StringValue topic) {
                c.subscribe(topic.value(), JOINT_STATE);
            } else {
                logger.warn("ignoring non-string entry [{}] in {}/source_list", source, c.fullName());
            }
        }
        c.publish("joint_states", JOINT_STATE);
    }
}
