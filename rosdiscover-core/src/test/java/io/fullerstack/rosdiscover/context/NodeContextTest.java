package io.fullerstack.rosdiscover.context;

import io.fullerstack.rosdiscover.io.FileSystem;
import io.fullerstack.rosdiscover.parameter.ParameterServer;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import io.fullerstack.rosdiscover.summary.NodeSummary;
import io.fullerstack.rosdiscover.summary.ParameterRead;
import io.fullerstack.rosdiscover.summary.TypedName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("NodeContext")
class NodeContextTest {

    private ParameterServer params;
    private FileSystem files;

    @BeforeEach
    void setUp() {
        params = new ParameterServer();
        files = mock(FileSystem.class);
    }

    private NodeContext context(Map<String, String> remappings) {
        return NodeContext.builder()
            .name("camera")
            .namespace("/robot")
            .kind("driver")
            .packageName("camera_pkg")
            .args("--fast")
            .remappings(remappings)
            .params(params)
            .files(files)
            .build();
    }

    private NodeContext context() {
        return context(Map.of());
    }

    // =========================================================================
    // Name resolution
    // =========================================================================

    @Test
    void testResolve_GlobalNameUnchanged() {
        assertThat(context().resolve("/scan")).isEqualTo("/scan");
    }

    @Test
    void testResolve_PrivateNameQualifiedUnderNode() {
        assertThat(context().resolve("~image_raw")).isEqualTo("/camera/image_raw");
    }

    @Test
    void testResolve_RelativeNameIgnoresNamespace() {
        assertThat(context().resolve("image_raw")).isEqualTo("/image_raw");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/a", "~a", "a", "a/b", "~a/b"})
    void testResolve_IsIdempotent(String name) {
        NodeContext context = context();
        String once = context.resolve(name);

        assertThat(context.resolve(once)).isEqualTo(once);
    }

    @Test
    void testResolve_EmptyNameRejected() {
        assertThatThrownBy(() -> context().resolve(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // Remapping
    // =========================================================================

    @Test
    void testPublish_AppliesRemapping() {
        NodeContext context = context(Map.of("a", "b"));

        context.publish("a", "T");

        assertThat(context.remappings()).containsEntry("/a", "/b");
        assertThat(context.summarize().pubs()).containsExactly(new TypedName("/b", "T"));
    }

    @Test
    void testRemapping_PrivateSourceResolvedUnderNode() {
        NodeContext context = context(Map.of("~image", "/front/image"));

        context.subscribe("~image", "sensor_msgs/Image");
        context.provideService("~image", "std_srvs/Empty");

        NodeSummary summary = context.summarize();
        assertThat(summary.subs()).containsExactly(new TypedName("/front/image", "sensor_msgs/Image"));
        assertThat(summary.provides()).containsExactly(new TypedName("/front/image", "std_srvs/Empty"));
    }

    @Test
    void testRemapping_UnrelatedNamesUntouched() {
        NodeContext context = context(Map.of("a", "b"));

        context.useService("c", "S");

        assertThat(context.summarize().uses()).containsExactly(new TypedName("/c", "S"));
    }

    // =========================================================================
    // Topics and services
    // =========================================================================

    @Test
    void testSubscribe_DuplicateDeclarationsCollapse() {
        NodeContext context = context();

        context.subscribe("/x", "T");
        context.subscribe("x", "T");

        assertThat(context.summarize().subs()).containsExactly(new TypedName("/x", "T"));
    }

    @Test
    void testSameTopicWithDifferentFormats_AreDistinct() {
        NodeContext context = context();

        context.publish("/x", "A");
        context.publish("/x", "B");

        assertThat(context.summarize().pubs()).hasSize(2);
    }

    @Test
    void testServices_RecordedSeparately() {
        NodeContext context = context();

        context.provideService("reset", "std_srvs/Empty");
        context.useService("/map_server/static_map", "nav_msgs/GetMap");

        NodeSummary summary = context.summarize();
        assertThat(summary.provides()).containsExactly(new TypedName("/reset", "std_srvs/Empty"));
        assertThat(summary.uses()).containsExactly(new TypedName("/map_server/static_map", "nav_msgs/GetMap"));
    }

    // =========================================================================
    // Actions
    // =========================================================================

    @Test
    void testProvideAction_ExpandsToFiveTopics() {
        NodeContext context = context();

        context.provideAction("/fetch", "ExampleAction");

        NodeSummary summary = context.summarize();
        assertThat(summary.actionServers()).containsExactly(new TypedName("/fetch", "ExampleAction"));
        assertThat(summary.subs()).containsExactlyInAnyOrder(
            new TypedName("/fetch/goal", "ExampleActionGoal"),
            new TypedName("/fetch/cancel", "actionlib_msgs/GoalID"));
        assertThat(summary.pubs()).containsExactlyInAnyOrder(
            new TypedName("/fetch/status", "actionlib_msgs/GoalStatusArray"),
            new TypedName("/fetch/feedback", "ExampleActionFeedback"),
            new TypedName("/fetch/result", "ExampleActionResult"));
    }

    @Test
    void testUseAction_InvertsDirections() {
        NodeContext server = context();
        server.provideAction("/fetch", "ExampleAction");
        NodeSummary serverSummary = server.summarize();

        NodeContext client = context();
        client.useAction("/fetch", "ExampleAction");
        NodeSummary clientSummary = client.summarize();

        assertThat(clientSummary.actionClients()).containsExactly(new TypedName("/fetch", "ExampleAction"));
        assertThat(clientSummary.actionServers()).isEmpty();
        assertThat(clientSummary.pubs()).isEqualTo(serverSummary.subs());
        assertThat(clientSummary.subs()).isEqualTo(serverSummary.pubs());
    }

    @Test
    void testAction_RelativeNamespaceResolvedAndTopicsRemapped() {
        NodeContext context = context(Map.of("/move/goal", "/planner/goal"));

        context.useAction("move", "nav/MoveAction");

        NodeSummary summary = context.summarize();
        assertThat(summary.actionClients()).containsExactly(new TypedName("/move", "nav/MoveAction"));
        assertThat(summary.pubs()).contains(new TypedName("/planner/goal", "nav/MoveActionGoal"));
        assertThat(summary.pubs()).doesNotContain(new TypedName("/move/goal", "nav/MoveActionGoal"));
    }

    // =========================================================================
    // Parameters and files
    // =========================================================================

    @Test
    void testReadParameter_ReturnsStoredValueAndRecordsRead() {
        params.set("/camera/fps", ParameterValue.of(15));
        NodeContext context = context();

        ParameterValue fps = context.readParameter("~fps", ParameterValue.of(30), true);
        ParameterValue mode = context.readParameter("mode", ParameterValue.of("auto"));

        assertThat(fps).isEqualTo(ParameterValue.of(15));
        assertThat(mode).isEqualTo(ParameterValue.of("auto"));
        assertThat(params.contains("/mode")).isFalse();
        assertThat(context.summarize().reads()).containsExactlyInAnyOrder(
            new ParameterRead("/camera/fps", true),
            new ParameterRead("/mode", false));
    }

    @Test
    void testReadParameter_WithoutDefault() {
        NodeContext context = context();

        assertThat(context.readParameter("robot_description")).isEmpty();
        assertThat(context.summarize().reads()).containsExactly(new ParameterRead("/robot_description", false));
    }

    @Test
    void testWriteParameter_StoresAndRecords() {
        NodeContext context = context();

        context.writeParameter("~ready", ParameterValue.of(true));

        assertThat(params.get("/camera/ready")).contains(ParameterValue.of(true));
        assertThat(context.summarize().writes()).containsExactly("/camera/ready");
    }

    @Test
    void testReadFile_DelegatesWithoutRecording() {
        when(files.read("/etc/calibration.yaml")).thenReturn("k: 1");
        NodeContext context = context();

        assertThat(context.readFile("/etc/calibration.yaml")).isEqualTo("k: 1");

        NodeSummary summary = context.summarize();
        assertThat(summary.reads()).isEmpty();
        assertThat(summary.subs()).isEmpty();
        verify(files).read("/etc/calibration.yaml");
    }

    // =========================================================================
    // Summary
    // =========================================================================

    @Test
    void testSummarize_CarriesIdentity() {
        NodeContext context = context();
        context.markNodelet();

        NodeSummary summary = context.summarize();

        assertThat(summary.name()).isEqualTo("camera");
        assertThat(summary.fullName()).isEqualTo("/robot/camera");
        assertThat(summary.namespace()).isEqualTo("/robot");
        assertThat(summary.kind()).isEqualTo("driver");
        assertThat(summary.packageName()).isEqualTo("camera_pkg");
        assertThat(summary.nodelet()).isTrue();
        assertThat(summary.placeholder()).isFalse();
        assertThat(context.args()).isEqualTo("--fast");
    }

    @Test
    void testFullName_NamespaceWithTrailingSlash() {
        NodeContext context = NodeContext.builder()
            .name("talker").namespace("/").kind("talker").packageName("demo")
            .params(params).files(files).build();

        assertThat(context.fullName()).isEqualTo("/talker");
        assertThat(context.args()).isEmpty();
    }

    @Test
    void testSummaries_WithSameInteractionsAreEqual() {
        NodeContext first = context();
        first.publish("/x", "T");
        NodeContext second = context();
        second.publish("x", "T");

        NodeSummary firstSummary = first.summarize();
        NodeSummary secondSummary = second.summarize();

        assertThat(firstSummary).isEqualTo(secondSummary).hasSameHashCodeAs(secondSummary);
        assertThat(new HashSet<>(List.of(firstSummary, secondSummary))).hasSize(1);
    }

    @Test
    void testSummarize_ClosesContext() {
        NodeContext context = context();
        context.summarize();

        assertThatThrownBy(context::summarize).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> context.publish("/x", "T"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already been summarized");
    }
}
