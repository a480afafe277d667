package com.wildtrack.ats.parser;

import lombok.Value;

/**
 * Where a payload came from.  Carried into every rejection so that operators can find the
 * integration and vendor account involved; never holds credentials beyond the username.
 */
@Value
public class ParseContext {

    String integrationId;
    String endpoint;
    String username;
}
