package io.fullerstack.rosdiscover.spi;

import io.fullerstack.rosdiscover.model.Model;

import java.util.List;

/**
 * Service Provider Interface for contributing node models.
 * <p>
 * Each implementation enumerates the models it contributes; the bootstrap registers every
 * model of every provider before any interpreter session starts. Adding support for a new
 * package means adding a provider, never changing the interpreter.
 * <p>
 * <strong>Example Implementation:</strong>
 * <pre>
 * public class CameraModels implements ModelProvider {
 *     &#64;Override
 *     public List&lt;Model&gt; models() {
 *         return List.of(
 *             Model.of("usb_cam", "usb_cam_node", c -&gt; {
 *                 c.publish("~image_raw", "sensor_msgs/Image");
 *                 c.readParameter("~framerate", ParameterValue.of(30));
 *             })
 *         );
 *     }
 * }
 * </pre>
 * <p>
 * <strong>Registration:</strong>
 * Create file: {@code META-INF/services/io.fullerstack.rosdiscover.spi.ModelProvider}
 * <pre>
 * com.example.CameraModels
 * </pre>
 *
 * @see java.util.ServiceLoader
 * @see io.fullerstack.rosdiscover.bootstrap.RosDiscoverBootstrap
 */
public interface ModelProvider {

    /**
     * @return models contributed by this provider
     */
    List<Model> models();
}
