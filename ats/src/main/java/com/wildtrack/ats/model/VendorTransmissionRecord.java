package com.wildtrack.ats.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One transmission session of an ATS collar.  Used to learn the collar's GMT offset and for
 * nearest-date lookups; never forwarded downstream.
 */
@Value
@Builder
public class VendorTransmissionRecord {

    String collarSerialNum;
    LocalDateTime dateSent;
    Integer numberFixes;
    Double battVoltage;
    String mortality;
    String breakOff;
    String satErrors;
    String yearBase;
    String dayBase;
    /** Hours between the collar's clock and UTC. */
    Integer gmtOffset;
    Boolean lowBattVoltage;
}
