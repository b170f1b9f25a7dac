package com.kmg.extract.service;

import java.util.List;

/**
 * Output fields of an insurance policy extraction, in output order.
 */
public final class ExtractionSchema {
    public static final String COMPANY_FIELD = "INSURANCE_COMPANY_NAME";

    public static final List<String> FIELDS = List.of(
            "BROKER_NAME", "CC", "CGST", "CHASIS_NUMBER", "CITY_NAME", "COVER",
            "CUSTOMER_EMAIL", "CUSTOMER_NAME", "CV_TYPE", "ENGINE_NUMBER",
            "FINANCIER_NAME", "FUEL_TYPE", "GST", "GVW", "IDV_SUM_INSURED",
            "IGST", COMPANY_FIELD, "COMPLETE_LOCATION_ADDRESS",
            "MOB_NO", "NCB", "NET_PREMIUM", "NOMINEE_NAME", "NOMINEE_RELATIONSHIP",
            "OD_EXPIRE_DATE", "OD_PREMIUM", "PINCODE", "POLICY_ISSUE_DATE",
            "POLICY_NO", "PRODUCT_CODE", "REGISTRATION_DATE", "REGISTRATION_NUMBER",
            "RISK_END_DATE", "RISK_START_DATE", "SGST", "STATE_NAME",
            "TOTAL_PREMIUM", "TP_ONLY_PREMIUM", "VEHICLE_MAKE", "VEHICLE_MODEL",
            "VEHICLE_SUB_TYPE", "VEHICLE_VARIANT", "YEAR_OF_MANUFACTURE"
    );

    private ExtractionSchema() {
    }
}
