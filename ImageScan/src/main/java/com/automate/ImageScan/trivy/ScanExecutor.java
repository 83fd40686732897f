package com.automate.ImageScan.trivy;

/**
 * Runs the vulnerability scanning engine against a single image.
 */
public interface ScanExecutor {

    /**
     * Blocks until the engine has produced its machine-readable report.
     *
     * @param image image reference such as {@code registry/name:tag}
     * @return the engine output of a successful run
     * @throws com.automate.ImageScan.exception.InvalidImageReferenceException blank image, nothing spawned
     * @throws com.automate.ImageScan.exception.ScanTimeoutException engine ran past its timeout and was killed
     * @throws com.automate.ImageScan.exception.ScanEngineException engine failed, could not start or was interrupted
     */
    RawScanOutput execute(String image);
}
