package de.conciso.medcontext.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.conciso.medcontext.model.PatientCase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;

@Service
public class CaseFileLoader {

    private final String casePath;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public CaseFileLoader(@Value("${medcontext.case.path:case.yml}") String casePath) {
        this.casePath = casePath;
    }

    public PatientCase load() throws IOException {
        return yaml.readValue(new File(casePath), PatientCase.class);
    }

    public String casePath() {
        return casePath;
    }
}
