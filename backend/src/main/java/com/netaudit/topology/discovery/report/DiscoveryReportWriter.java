package com.netaudit.topology.discovery.report;

import com.netaudit.topology.discovery.model.ResultSnapshot;

import java.io.IOException;
import java.util.List;

public interface DiscoveryReportWriter {

    /**
     * Fails when reports could not be written, so a run can be refused before it starts.
     */
    void verifyDestination() throws IOException;

    /**
     * @return paths of the files written
     */
    List<String> write(String siteName, ResultSnapshot snapshot) throws IOException;
}
