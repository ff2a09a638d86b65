package com.weatherexporter.collectors.api;

import com.weatherexporter.core.model.ObservationField;

@FunctionalInterface
public interface FieldRejectionListener {
    FieldRejectionListener NONE = (field, reason, unitCode) -> {
    };

    /**
     * @param unitCode the unit code as reported, possibly empty
     */
    void rejected(ObservationField field, FieldRejectionReason reason, String unitCode);
}
