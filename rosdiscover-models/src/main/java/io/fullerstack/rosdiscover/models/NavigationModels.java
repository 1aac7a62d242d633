package io.fullerstack.rosdiscover.models;

import io.fullerstack.rosdiscover.context.NodeContext;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import lombok.experimental.UtilityClass;

/**
 * Models for the ROS navigation stack.
 */
@UtilityClass
public class NavigationModels {

    public void moveBase(NodeContext c) {
        c.readParameter("~base_global_planner", ParameterValue.of("navfn/NavfnROS"));
        c.readParameter("~base_local_planner", ParameterValue.of("base_local_planner/TrajectoryPlannerROS"));
        c.readParameter("~controller_frequency", ParameterValue.of(20.0), true);
        c.readParameter("~planner_frequency", ParameterValue.of(0.0), true);

        c.provideAction("move_base", "move_base_msgs/MoveBaseAction");
        c.subscribe("move_base_simple/goal", "geometry_msgs/PoseStamped");
        c.publish("cmd_vel", "geometry_msgs/Twist");
        c.provideService("~make_plan", "nav_msgs/GetPlan");
        c.provideService("~clear_costmaps", "std_srvs/Empty");
    }
}
