package org.rostilos.devopsbridge.azdoclient.model;

/**
 * Outcome of looking up a single ref by its exact name.
 */
public sealed interface RefLookup permits RefLookup.Found, RefLookup.NotFound {

    String refName();

    record Found(BranchPointer pointer) implements RefLookup {
        @Override
        public String refName() {
            return pointer.refName();
        }

        public String objectId() {
            return pointer.objectId();
        }
    }

    record NotFound(String refName) implements RefLookup {
    }
}
