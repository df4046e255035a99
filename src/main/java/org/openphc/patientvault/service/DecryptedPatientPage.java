package org.openphc.patientvault.service;

import lombok.Builder;
import lombok.Value;
import org.openphc.patientvault.api.dto.PatientDto;

import java.util.List;

/**
 * Decrypted page of one manager's patients. {@code withheld} counts records dropped
 * because they failed decryption; {@code total} is the stored count.
 */
@Value
@Builder
public class DecryptedPatientPage {

    List<PatientDto> patients;
    long total;
    int page;
    int limit;
    int withheld;
}
