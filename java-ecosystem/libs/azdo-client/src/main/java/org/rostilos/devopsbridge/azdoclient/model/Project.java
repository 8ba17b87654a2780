package org.rostilos.devopsbridge.azdoclient.model;

public record Project(String id, String name, String state) {
}
