package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Protection zone a rule is scoped to.
 *
 * @param zoneType catalog zone type, e.g. {@code ruhezone}; may be null
 * @param zoneName name of the zone as written in the regulation; may be null
 */
public record Zone(
        @JsonProperty("zone_typ")  String zoneType,
        @JsonProperty("zone_name") String zoneName
) {}
