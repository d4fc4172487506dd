package com.github.stormino.medialib.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cookie-jar text submitted by a tenant.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialUpload {

    private String cookies;
}
