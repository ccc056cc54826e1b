/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.rangemetrics.state;

/**
 * A mapper between a model and a plain state object that can be serialized.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * Create a state object representing the given model.
     *
     * @param model a model instance
     * @return a state object capturing the model
     */
    State toState(Model model);

    /**
     * Recreate a model from a state object.
     *
     * @param state a state object
     * @return a model equivalent to the one the state was created from
     */
    Model toModel(State state);
}
