package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.context.NodeContext;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import lombok.experimental.UtilityClass;

/**
 * Models for image-processing nodelets.
 */
@UtilityClass
public class PerceptionModels {

    public void pointCloudXyz(NodeContext c) {
        c.readParameter("~queue_size", ParameterValue.of(5));

        c.subscribe("image_rect", "sensor_msgs/Image");
        c.subscribe("camera_info", "sensor_msgs/CameraInfo");
        c.publish("points", "sensor_msgs/PointCloud2");
    }
}
