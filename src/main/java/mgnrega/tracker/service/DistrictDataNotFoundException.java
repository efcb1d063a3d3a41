package mgnrega.tracker.service;

public class DistrictDataNotFoundException extends RuntimeException {

    private final String stateCode;
    private final String districtName;

    public DistrictDataNotFoundException(String stateCode, String districtName) {
        super("No data found for district '" + districtName + "' in state '" + stateCode + "'");
        this.stateCode = stateCode;
        this.districtName = districtName;
    }

    public String getStateCode() {
        return stateCode;
    }

    public String getDistrictName() {
        return districtName;
    }
}
