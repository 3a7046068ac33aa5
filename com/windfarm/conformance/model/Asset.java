package com.windfarm.conformance.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 资产（风机）静态属性。加载后不可变，各时序数据只通过assetId引用。
 */
public final class Asset implements Serializable {
    private final String assetId;
    private final String type;
    private final Double latitude;
    private final Double longitude;
    /** 额定功率（kW） */
    private final Double ratedPower;
    /** 轮毂高度（m） */
    private final Double hubHeight;
    /** 叶轮直径（m） */
    private final Double rotorDiameter;
    /** 海拔（m） */
    private final Double elevation;

    public Asset(String assetId, String type, Double latitude, Double longitude,
                 Double ratedPower, Double hubHeight, Double rotorDiameter, Double elevation) {
        this.assetId = Objects.requireNonNull(assetId, "assetId");
        this.type = type;
        this.latitude = latitude;
        this.longitude = longitude;
        this.ratedPower = ratedPower;
        this.hubHeight = hubHeight;
        this.rotorDiameter = rotorDiameter;
        this.elevation = elevation;
    }

    public String getAssetId() { return assetId; }
    public String getType() { return type; }
    public Double getLatitude() { return latitude; }
    public Double getLongitude() { return longitude; }
    public Double getRatedPower() { return ratedPower; }
    public Double getHubHeight() { return hubHeight; }
    public Double getRotorDiameter() { return rotorDiameter; }
    public Double getElevation() { return elevation; }

    /** 按属性名取值，供契约校验使用 */
    public Object getAttribute(String attribute) {
        switch (attribute) {
            case "asset_id": return assetId;
            case "type": return type;
            case "latitude": return latitude;
            case "longitude": return longitude;
            case "rated_power": return ratedPower;
            case "hub_height": return hubHeight;
            case "rotor_diameter": return rotorDiameter;
            case "elevation": return elevation;
            default: throw new IllegalArgumentException("Unknown asset attribute: " + attribute);
        }
    }

    @Override
    public String toString() {
        return "Asset{" + assetId + ", type=" + type + ", ratedPower=" + ratedPower
                + ", hubHeight=" + hubHeight + ", rotorDiameter=" + rotorDiameter + "}";
    }
}
