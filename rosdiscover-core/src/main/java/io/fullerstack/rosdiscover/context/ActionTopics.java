package io.fullerstack.rosdiscover.context;

import lombok.experimental.UtilityClass;

/**
 * Topic layout of the actionlib protocol.
 * <p>
 * An action named {@code ns} with format {@code F} runs over five topics:
 * <pre>
 *   ns/goal      FGoal                           client → server
 *   ns/cancel    actionlib_msgs/GoalID           client → server
 *   ns/status    actionlib_msgs/GoalStatusArray  server → client
 *   ns/feedback  FFeedback                       server → client
 *   ns/result    FResult                         server → client
 * </pre>
 */
@UtilityClass
public class ActionTopics {

    public final String CANCEL_FORMAT = "actionlib_msgs/GoalID";
    public final String STATUS_FORMAT = "actionlib_msgs/GoalStatusArray";

    public String goal(String ns) {
        return ns + "/goal";
    }

    public String cancel(String ns) {
        return ns + "/cancel";
    }

    public String status(String ns) {
        return ns + "/status";
    }

    public String feedback(String ns) {
        return ns + "/feedback";
    }

    public String result(String ns) {
        return ns + "/result";
    }

    public String goalFormat(String format) {
        return format + "Goal";
    }

    public String feedbackFormat(String format) {
        return format + "Feedback";
    }

    public String resultFormat(String format) {
        return format + "Result";
    }
}
