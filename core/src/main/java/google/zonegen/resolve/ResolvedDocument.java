// Copyright 2025 The Nomulus Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package google.zonegen.resolve;

import com.google.common.collect.ImmutableList;

/** Every zone and reverse network of a document, ready to be turned into records. */
public record ResolvedDocument(
    ImmutableList<ResolvedZone> zones, ImmutableList<ResolvedReverseNetwork> reverseNetworks) {}
