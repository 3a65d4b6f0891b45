package org.ohnlp.cdm.timeline.structs;

public enum DischargeStatus {
    ALIVE,
    DECEASED
}
