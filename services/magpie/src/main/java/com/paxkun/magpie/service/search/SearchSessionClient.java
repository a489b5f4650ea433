package com.paxkun.magpie.service.search;

import com.paxkun.magpie.exception.ProviderException;
import com.paxkun.magpie.exception.SearchNetworkException;
import com.paxkun.magpie.exception.SessionTokenException;

import java.util.List;

/**
 * One complete handshake with the image search provider under a single identity.
 */
public interface SearchSessionClient {

    /**
     * @return the raw, unfiltered results; never empty
     * @throws SessionTokenException  the search page carried no session token
     * @throws ProviderException      non-2xx, malformed payload or zero results
     * @throws SearchNetworkException timeout, DNS or connect failure
     */
    List<RawImageResult> search(String keyword, Identity identity);
}
