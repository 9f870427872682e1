package com.jroute.kb;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

public record AirwayExpansion(boolean expanded, ImmutableList<String> fixes, String error) {

    public static AirwayExpansion of(ImmutableList<String> fixes) {
        return new AirwayExpansion(true, fixes, null);
    }

    public static AirwayExpansion failed(String error) {
        return new AirwayExpansion(false, Lists.immutable.empty(), error);
    }
}
