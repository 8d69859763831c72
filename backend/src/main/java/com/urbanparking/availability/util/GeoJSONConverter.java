package com.urbanparking.availability.util;

import com.urbanparking.availability.dto.BayDTO;
import com.urbanparking.availability.model.Bay;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GeoJSONConverter {

    // WGS84
    private static final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);

    public static Map<String, Object> convertToGeoJSON(List<Bay> bays, long snapshotVersion) {
        Map<String, Object> featureCollection = new LinkedHashMap<>();
        featureCollection.put("type", "FeatureCollection");
        featureCollection.put("snapshotVersion", snapshotVersion);

        List<Map<String, Object>> features = new ArrayList<>(bays.size());

        for (Bay bay : bays) {
            Map<String, Object> feature = new LinkedHashMap<>();
            feature.put("type", "Feature");
            feature.put("id", bay.getBayId());

            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("kerbside_id", bay.getBayId());
            properties.put("status", bay.getState().name());
            properties.put("road_segment", bay.getStreetName());
            properties.put("zone_number", bay.getZoneNumber());
            properties.put("last_updated", bay.getLastUpdated() != null ? bay.getLastUpdated().toString() : null);

            feature.put("properties", properties);
            feature.put("geometry", convertPointToGeoJSON(toPoint(bay)));

            features.add(feature);
        }

        featureCollection.put("features", features);
        return featureCollection;
    }

    public static Point toPoint(Bay bay) {
        return geometryFactory.createPoint(new Coordinate(bay.getLongitude(), bay.getLatitude()));
    }

    private static Map<String, Object> convertPointToGeoJSON(Point point) {
        Map<String, Object> geometry = new LinkedHashMap<>();
        geometry.put("type", "Point");

        List<Double> coordinates = new ArrayList<>(2);
        coordinates.add(point.getX());
        coordinates.add(point.getY());
        geometry.put("coordinates", coordinates);

        return geometry;
    }

    public static BayDTO convertToDTO(Bay bay) {
        BayDTO dto = new BayDTO();
        dto.setKerbsideId(bay.getBayId());
        dto.setLatitude(bay.getLatitude());
        dto.setLongitude(bay.getLongitude());
        dto.setStatus(bay.getState().name());
        dto.setRoadSegment(bay.getStreetName());
        dto.setZoneNumber(bay.getZoneNumber());
        dto.setLastUpdated(bay.getLastUpdated());

        return dto;
    }
}
