/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package hep.dec.ast;

import com.google.common.collect.ImmutableSet;

/**
 * Names of the decay models known to EvtGen.
 *
 * A decay line is a list of labels with the model name somewhere in the
 * middle, so the lexer uses this set to tell model names apart from
 * particle names.
 */
public class DecModels {

  private static final ImmutableSet<String> MODEL_NAMES = ImmutableSet.of(
      "BaryonPCR", "BC_SMN", "BC_TMN", "BC_VHAD", "BC_VMN", "BCL", "BGL",
      "BSTOGLLISRFSR", "BSTOGLLMNT", "BTO3PI_CP", "BTO4PI_CP",
      "BTODDALITZCPK", "BToDiBaryonlnupQCD", "BTOSLLALI", "BTOSLLBALL",
      "BTOSLLMS", "BTOSLLMSEXT", "BTOVLNUBALL", "BTOXELNU", "BTOXSGAMMA",
      "BTOXSLL", "CB3PI-MPP", "CB3PI-P00", "D_DALITZ", "D_hhhh", "DMIX",
      "ETA_DALITZ", "ETA_FULLDALITZ", "ETA_PI0DALITZ", "ETAPRIME_DALITZ",
      "FLATQ2", "FLATSQDALITZ", "FOURBODYPHSP", "GENERIC_DALITZ",
      "GOITY_ROBERTS", "HELAMP", "HQET", "HQET2", "HQET3", "ISGW", "ISGW2",
      "JETSET", "JSCONT", "KKPI0_DALITZ", "KSTARNUNU", "KSTARSTARGAMMA",
      "LAMBDAB2LAMBDAV", "LAMBDA2PPIFORLAMBDAB2LAMBDAV", "LbAmpGen",
      "LLSW", "LNUGAMMA", "MELIKHOV", "OMEGA_DALITZ", "PARTWAVE",
      "PHSP", "PHSPDECAYTIMECUT", "PHSPFLATLIFETIME", "PI0_DALITZ",
      "PROPSLPOLE", "PTO3P", "PVV_CPLH", "PYCONT", "PYTHIA", "SINGLE",
      "SLBKPOLE", "SLN", "SLPOLE", "SSD_CP", "SSD_DirectCP", "SSS_CP",
      "SSS_CP_PNG", "STS", "STS_CP", "SVP", "SVP_CVS", "SVP_HELAMP", "SVS",
      "SVS_CP", "SVS_CP_ISO", "SVS_CPLH", "SVS_NONCPEIGEN", "SVV_CP",
      "SVV_CPLH", "SVV_HELAMP", "SVV_NONCPEIGEN", "TAUHADNU", "TAULNUNU",
      "TAUOLA", "TAUSCALARNU", "TAUVECTORNU", "THREEBODYPHSP", "TSS", "TVP",
      "TVS_PWAVE", "VECTORISR", "VLL", "VPHOTOVISRHI", "VSP_PWAVE", "VSS",
      "VSS_BMIX", "VSS_MIX", "VTOSLL", "VUB", "VUB_BLNP", "VVP", "VVPIPI",
      "VVS_PWAVE", "XLL", "Y3STOY1SPIPIMOXHAY", "YMSTOYNSPIPICLEO");

  public static boolean isModelName(String label) {
    return MODEL_NAMES.contains(label);
  }
}
