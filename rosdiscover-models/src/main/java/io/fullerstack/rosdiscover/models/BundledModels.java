package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.model.Model;
import io.fullerstack.rosdiscover.spi.ModelProvider;

import java.util.List;

/**
 * Provides the models shipped with rosdiscover.
 */
public class BundledModels implements ModelProvider {

    @Override
    public List<Model> models() {
        return List.of(
            Model.of("image_transport", "republish", ImageTransportModels::republish),
            Model.of("robot_state_publisher", "robot_state_publisher", RobotModelModels::robotStatePublisher),
            Model.of("joint_state_publisher", "joint_state_publisher", RobotModelModels::jointStatePublisher),
            Model.of("move_base", "move_base", NavigationModels::moveBase),
            Model.of("depth_image_proc", "point_cloud_xyz", PerceptionModels::pointCloudXyz),
            Model.of("topic_tools", "relay", TopicToolsModels::relay)
        );
    }
}
