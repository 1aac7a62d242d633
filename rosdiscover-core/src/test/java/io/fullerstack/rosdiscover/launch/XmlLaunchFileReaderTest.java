package io.fullerstack.rosdiscover.launch;

import io.fullerstack.rosdiscover.io.FileSystem;
import io.fullerstack.rosdiscover.io.Shell;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("XmlLaunchFileReader")
class XmlLaunchFileReaderTest {

    private FileSystem files;
    private Shell shell;
    private XmlLaunchFileReader reader;

    @BeforeEach
    void setUp() {
        files = mock(FileSystem.class);
        shell = mock(Shell.class);
        reader = new XmlLaunchFileReader(files, shell, "rospack find");
    }

    private void file(String path, String xml) {
        when(files.read(path)).thenReturn(xml);
    }

    private LaunchConfig read(String xml) {
        file("/ws/robot.launch", xml);
        return reader.read("/ws/robot.launch", Map.of());
    }

    @Nested
    @DisplayName("nodes")
    class Nodes {

        @Test
        void testNode_DescriptorCarriesDeclaration() {
            LaunchConfig config = read("""
                <launch>
                  <node pkg="image_proc" type="image_proc" name="rectifier" args="--fast" />
                </launch>
                """);

            assertThat(config.nodes()).containsExactly(
                new NodeDescriptor("rectifier", "image_proc", "image_proc", "/", "--fast", List.of()));
        }

        @Test
        void testNode_GroupNamespaceAndRemappings() {
            LaunchConfig config = read("""
                <launch>
                  <remap from="scan" to="base_scan" />
                  <group ns="robot">
                    <node pkg="amcl" type="amcl" name="amcl">
                      <remap from="map" to="/static_map" />
                    </node>
                  </group>
                  <node pkg="map_server" type="map_server" name="map_server" />
                </launch>
                """);

            NodeDescriptor amcl = config.nodes().get(0);
            assertThat(amcl.namespace()).isEqualTo("/robot/");
            assertThat(amcl.remappings()).containsExactly(
                new Remapping("scan", "base_scan"),
                new Remapping("map", "/static_map"));
            assertThat(config.nodes().get(1).namespace()).isEqualTo("/");
            assertThat(config.nodes().get(1).remappings()).containsExactly(new Remapping("scan", "base_scan"));
        }

        @Test
        void testNode_GroupRemappingsDoNotLeak() {
            LaunchConfig config = read("""
                <launch>
                  <group ns="a">
                    <remap from="x" to="y" />
                  </group>
                  <node pkg="p" type="t" name="n" />
                </launch>
                """);

            assertThat(config.nodes().get(0).remappings()).isEmpty();
        }

        @Test
        void testNode_IfAndUnlessConditions() {
            LaunchConfig config = read("""
                <launch>
                  <arg name="gui" default="false" />
                  <node pkg="rviz" type="rviz" name="rviz" if="$(arg gui)" />
                  <node pkg="p" type="headless" name="headless" unless="$(arg gui)" />
                  <node pkg="p" type="always" name="always" if="1" />
                </launch>
                """);

            assertThat(config.nodes()).extracting(NodeDescriptor::name).containsExactly("headless", "always");
        }

        @Test
        void testNode_IfTogetherWithUnlessFails() {
            assertThatThrownBy(() -> read("""
                <launch>
                  <node pkg="p" type="t" name="n" if="true" unless="true" />
                </launch>
                """))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("'if' and 'unless'")
                .hasMessageContaining("<node>");
        }

        @Test
        void testNode_MissingAttributeFails() {
            assertThatThrownBy(() -> read("<launch><node pkg=\"p\" name=\"n\" /></launch>"))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("type");
        }

        @Test
        void testUnknownElementsAreSkipped() {
            LaunchConfig config = read("""
                <launch>
                  <machine name="local" address="localhost" />
                  <env name="ROSCONSOLE_FORMAT" value="x" />
                  <node pkg="p" type="t" name="n" />
                </launch>
                """);

            assertThat(config.nodes()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("arguments and substitutions")
    class Substitutions {

        @Test
        void testArg_CommandLineOverridesDefault() {
            file("/ws/robot.launch", """
                <launch>
                  <arg name="robot" default="turtlebot" />
                  <node pkg="$(arg robot)_driver" type="driver" name="$(arg robot)" />
                </launch>
                """);

            LaunchConfig config = reader.read("/ws/robot.launch", Map.of("robot", "husky"));

            assertThat(config.nodes().get(0).packageName()).isEqualTo("husky_driver");
            assertThat(config.nodes().get(0).name()).isEqualTo("husky");
        }

        @Test
        void testArg_ValueCannotBeOverridden() {
            file("/ws/robot.launch", """
                <launch>
                  <arg name="robot" value="fixed" />
                  <node pkg="p" type="t" name="$(arg robot)" />
                </launch>
                """);

            LaunchConfig config = reader.read("/ws/robot.launch", Map.of("robot", "other"));

            assertThat(config.nodes().get(0).name()).isEqualTo("fixed");
        }

        @Test
        void testArg_UnsetArgumentFails() {
            assertThatThrownBy(() -> read("""
                <launch>
                  <arg name="robot" />
                  <node pkg="p" type="t" name="$(arg robot)" />
                </launch>
                """))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("robot");
        }

        @Test
        void testFind_ResolvedThroughShell() {
            when(shell.runAndCapture("rospack find robot_description")).thenReturn("/opt/ros/robot_description\n");
            file("/opt/ros/robot_description/launch/upload.launch", """
                <launch>
                  <node pkg="robot_state_publisher" type="robot_state_publisher" name="rsp" />
                </launch>
                """);

            LaunchConfig config = read("""
                <launch>
                  <include file="$(find robot_description)/launch/upload.launch" />
                </launch>
                """);

            assertThat(config.nodes()).extracting(NodeDescriptor::name).containsExactly("rsp");
            verify(shell).runAndCapture("rospack find robot_description");
        }

        @Test
        void testUnsupportedSubstitutionFails() {
            assertThatThrownBy(() -> read("<launch><node pkg=\"p\" type=\"t\" name=\"$(anon n)\" /></launch>"))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("$(anon)");
        }
    }

    @Nested
    @DisplayName("parameters")
    class Parameters {

        @Test
        void testParam_TypesAndQualification() {
            LaunchConfig config = read("""
                <launch>
                  <param name="use_sim_time" value="true" />
                  <param name="rate" value="10" />
                  <param name="scale" value="0.5" />
                  <param name="label" type="str" value="10" />
                  <group ns="robot">
                    <param name="/absolute" value="a" />
                    <param name="relative" value="r" />
                  </group>
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/use_sim_time", ParameterValue.of(true))
                .containsEntry("/rate", ParameterValue.of(10))
                .containsEntry("/scale", ParameterValue.of(0.5))
                .containsEntry("/label", ParameterValue.of("10"))
                .containsEntry("/absolute", ParameterValue.of("a"))
                .containsEntry("/robot/relative", ParameterValue.of("r"));
        }

        @Test
        void testParam_PrivateToNode() {
            LaunchConfig config = read("""
                <launch>
                  <group ns="robot">
                    <node pkg="amcl" type="amcl" name="amcl">
                      <param name="laser_model_type" value="likelihood_field" />
                    </node>
                  </group>
                </launch>
                """);

            assertThat(config.parameters())
                .containsOnlyKeys("/robot/amcl/laser_model_type");
        }

        @Test
        void testParam_TextfileAndCommand() {
            when(files.read("/ws/robot.urdf")).thenReturn("<robot name=\"r\"/>");
            when(shell.runAndCapture("xacro /ws/robot.xacro")).thenReturn("<robot name=\"x\"/>");

            LaunchConfig config = read("""
                <launch>
                  <param name="urdf" textfile="/ws/robot.urdf" />
                  <param name="robot_description" command="xacro /ws/robot.xacro" />
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/urdf", ParameterValue.of("<robot name=\"r\"/>"))
                .containsEntry("/robot_description", ParameterValue.of("<robot name=\"x\"/>"));
        }

        @Test
        void testParam_IntegersBeyondIntRangeStayIntegral() {
            LaunchConfig config = read("""
                <launch>
                  <param name="stamp" value="1700000000000" />
                  <param name="seed" type="int" value="4294967296" />
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/stamp", ParameterValue.of(1700000000000L))
                .containsEntry("/seed", ParameterValue.of(4294967296L));
            assertThat(config.parameters().get("/stamp")).isNotEqualTo(ParameterValue.of(1.7e12));
        }

        @Test
        void testParam_InvalidIntFails() {
            assertThatThrownBy(() -> read("<launch><param name=\"n\" type=\"int\" value=\"ten\" /></launch>"))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("/n");
        }

        @Test
        void testParam_WithoutValueFails() {
            assertThatThrownBy(() -> read("<launch><param name=\"n\" /></launch>"))
                .isInstanceOf(LaunchFileException.class);
        }

        @Test
        void testRosparam_InlineMappingIsFlattened() {
            LaunchConfig config = read("""
                <launch>
                  <node pkg="move_base" type="move_base" name="move_base">
                    <rosparam>
                      controller_frequency: 10.0
                      recovery_behavior_enabled: false
                      local_costmap:
                        robot_radius: 0.2
                        inflation:
                          enabled: true
                    </rosparam>
                  </node>
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/move_base/controller_frequency", ParameterValue.of(10.0))
                .containsEntry("/move_base/recovery_behavior_enabled", ParameterValue.of(false))
                .containsEntry("/move_base/local_costmap/robot_radius", ParameterValue.of(0.2))
                .containsEntry("/move_base/local_costmap/inflation/enabled", ParameterValue.of(true))
                .containsKeys("/move_base/local_costmap", "/move_base/local_costmap/inflation");
            assertThat(config.parameters().get("/move_base/local_costmap").asMap())
                .containsEntry("robot_radius", ParameterValue.of(0.2));
        }

        @Test
        void testRosparam_NestedMappingUnderParamAttribute() {
            LaunchConfig config = read("""
                <launch>
                  <rosparam param="costmap">
                    obstacle_layer:
                      enabled: false
                  </rosparam>
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/costmap/obstacle_layer/enabled", ParameterValue.of(false))
                .containsKeys("/costmap", "/costmap/obstacle_layer");
        }

        @Test
        void testRosparam_FileWithParamAttribute() {
            when(files.read("/ws/joints.yaml")).thenReturn("- joint_a\n- joint_b\n");

            LaunchConfig config = read("""
                <launch>
                  <rosparam file="/ws/joints.yaml" param="source_list" ns="jsp" />
                </launch>
                """);

            assertThat(config.parameters())
                .containsEntry("/jsp/source_list", ParameterValue.of(List.of("joint_a", "joint_b")));
        }

        @Test
        void testRosparam_NonLoadCommandsSkipped() {
            LaunchConfig config = read("""
                <launch>
                  <rosparam command="delete" param="stale" />
                </launch>
                """);

            assertThat(config.parameters()).isEmpty();
        }
    }

    @Nested
    @DisplayName("includes")
    class Includes {

        @Test
        void testInclude_NamespaceArgsAndInheritedRemappings() {
            file("/ws/camera.launch", """
                <launch>
                  <arg name="camera" default="camera" />
                  <param name="frame" value="$(arg camera)_link" />
                  <node pkg="usb_cam" type="usb_cam_node" name="$(arg camera)" />
                </launch>
                """);

            LaunchConfig config = read("""
                <launch>
                  <remap from="image_raw" to="image" />
                  <include file="/ws/camera.launch" ns="front">
                    <arg name="camera" value="front_cam" />
                  </include>
                </launch>
                """);

            assertThat(config.parameters()).containsEntry("/front/frame", ParameterValue.of("front_cam_link"));
            assertThat(config.nodes()).containsExactly(new NodeDescriptor(
                "front_cam", "usb_cam", "usb_cam_node", "/front/", "",
                List.of(new Remapping("image_raw", "image"))));
        }

        @Test
        void testInclude_ParentArgsAreNotVisible() {
            file("/ws/child.launch", "<launch><node pkg=\"p\" type=\"t\" name=\"$(arg robot)\" /></launch>");

            assertThatThrownBy(() -> read("""
                <launch>
                  <arg name="robot" default="r" />
                  <include file="/ws/child.launch" />
                </launch>
                """))
                .isInstanceOf(LaunchFileException.class)
                .hasMessageContaining("/ws/child.launch");
        }
    }

    @Test
    void testRead_WrongRootElementFails() {
        assertThatThrownBy(() -> read("<robot name=\"r\"/>"))
            .isInstanceOf(LaunchFileException.class)
            .hasMessageContaining("<launch>");
    }

    @Test
    void testRead_MalformedXmlFails() {
        assertThatThrownBy(() -> read("<launch><node"))
            .isInstanceOf(LaunchFileException.class)
            .hasMessageContaining("failed to parse");
    }

    @Test
    void testJoinNamespace() {
        assertThat(XmlLaunchFileReader.joinNamespace("/", "")).isEqualTo("/");
        assertThat(XmlLaunchFileReader.joinNamespace("/", "robot")).isEqualTo("/robot/");
        assertThat(XmlLaunchFileReader.joinNamespace("/robot/", "arm")).isEqualTo("/robot/arm/");
        assertThat(XmlLaunchFileReader.joinNamespace("/robot/", "/other")).isEqualTo("/other/");
    }

    @Test
    void testQualifyParameter() {
        assertThat(XmlLaunchFileReader.qualifyParameter("/robot/", "rate")).isEqualTo("/robot/rate");
        assertThat(XmlLaunchFileReader.qualifyParameter("/robot/amcl/", "~rate")).isEqualTo("/robot/amcl/rate");
        assertThat(XmlLaunchFileReader.qualifyParameter("/robot/", "/rate")).isEqualTo("/rate");
    }
}
