package io.github.drompincen.acpbridge.runtime.progress;

import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;

public interface ProgressListener {

    void onProgress(ProgressUpdate update);
}
