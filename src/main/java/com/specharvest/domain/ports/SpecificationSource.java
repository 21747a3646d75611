package com.specharvest.domain.ports;

import com.specharvest.domain.model.RawCategory;

import java.util.List;

/**
 * Port for looking up the raw specification categories of one device.
 */
public interface SpecificationSource {

    List<RawCategory> fetchSpecification(String detailId) throws FetchException;
}
