package com.catagent.agent;

import com.catagent.shared.model.StreamSummary;

import java.io.IOException;

/**
 * Receiver of one streamed chat turn. An {@link IOException} from any method means the
 * client went away.
 */
public interface StreamSink {

    void start(String model, String provider) throws IOException;

    void delta(String content) throws IOException;

    void done(StreamSummary summary) throws IOException;

    void error(String code, String message) throws IOException;
}
