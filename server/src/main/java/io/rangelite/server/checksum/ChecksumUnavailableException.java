// file: server/src/main/java/io/rangelite/server/checksum/ChecksumUnavailableException.java
package io.rangelite.server.checksum;

/** No digest could be collected: the computation failed or did not finish in time. */
public class ChecksumUnavailableException extends Exception {

    public ChecksumUnavailableException(String message) {
        super(message);
    }
}
