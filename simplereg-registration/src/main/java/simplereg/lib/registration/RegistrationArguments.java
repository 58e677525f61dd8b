/*-
 * #%L
 * This file is part of SimpleReg.
 * %%
 * Copyright (C) 2024 SimpleReg developers
 * %%
 * SimpleReg is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SimpleReg is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SimpleReg.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package simplereg.lib.registration;

import java.util.List;

import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

/**
 * Everything a registration needs besides its images.
 * 
 * @author SimpleReg developers
 */
final class RegistrationArguments {

	private final RegistrationSettings settings;
	private final List<ParameterMap> parameterMaps;

	RegistrationArguments(RegistrationSettings settings, List<ParameterMap> parameterMaps) {
		this.settings = settings;
		this.parameterMaps = ParameterMaps.copyOf(parameterMaps);
	}

	RegistrationSettings getSettings() {
		return settings;
	}

	List<ParameterMap> getParameterMaps() {
		return parameterMaps;
	}

}
