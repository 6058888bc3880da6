package com.presentos.core.routing;

import com.presentos.core.model.HandlerKind;
import com.presentos.core.model.Intent;
import com.presentos.core.model.TaskField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The per-intent action table driving {@link DispatchRouter}.
 */
public final class RouteTable {

    private static final Map<Intent, RoutePlan> PLANS;

    static {
        var plans = new EnumMap<Intent, RoutePlan>(Intent.class);
        plans.put(Intent.TASK, new RoutePlan(Intent.TASK, true, false, HandlerKind.CALENDAR, TaskField.CALENDAR_LINK));
        plans.put(Intent.COMPLETE_TASK, new RoutePlan(Intent.COMPLETE_TASK, false, true, HandlerKind.EXPERIENCE, null));
        plans.put(Intent.CALENDAR, new RoutePlan(Intent.CALENDAR, true, false, HandlerKind.CALENDAR, TaskField.CALENDAR_LINK));
        plans.put(Intent.EMAIL, new RoutePlan(Intent.EMAIL, true, false, HandlerKind.EMAIL, TaskField.EMAIL_LINK));
        plans.put(Intent.RESEARCH, new RoutePlan(Intent.RESEARCH, false, false, HandlerKind.RESEARCH, null));
        plans.put(Intent.MESSAGE, new RoutePlan(Intent.MESSAGE, false, false, HandlerKind.MESSAGING, null));
        plans.put(Intent.UNKNOWN, new RoutePlan(Intent.UNKNOWN, false, false, null, null));
        PLANS = Collections.unmodifiableMap(plans);
    }

    private RouteTable() {}

    public static RoutePlan planFor(Intent intent) {
        return PLANS.get(intent);
    }
}
