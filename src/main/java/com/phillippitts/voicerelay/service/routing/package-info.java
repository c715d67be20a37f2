/**
 * Model and region selection.
 *
 * <p>{@link com.phillippitts.voicerelay.service.routing.ModelRegionSelector} evaluates an ordered
 * list of {@link com.phillippitts.voicerelay.service.routing.RoutingRule}s against the static
 * {@link com.phillippitts.voicerelay.service.routing.ModelCatalog} and
 * {@link com.phillippitts.voicerelay.service.routing.RegionAvailability} tables.
 */
package com.phillippitts.voicerelay.service.routing;
