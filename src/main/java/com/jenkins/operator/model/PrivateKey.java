package com.jenkins.operator.model;

import io.kubernetes.client.openapi.models.V1SecretKeySelector;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to the deploy key used to clone a seed job repository.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrivateKey {
    private V1SecretKeySelector secretKeyRef;
}
